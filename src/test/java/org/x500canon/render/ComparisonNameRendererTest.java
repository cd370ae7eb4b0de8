package org.x500canon.render;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.x500canon.name.OrderedAva;
import org.x500canon.name.OrderedName;

public class ComparisonNameRendererTest {
    private final ComparisonNameRenderer renderer = new ComparisonNameRenderer();

    @Test
    public void testKeepsOrderAndNormalizedValues() {
        OrderedName name = new OrderedName(Arrays.asList(
                Arrays.asList(new OrderedAva(0, "c", "xx", "XX")),
                Arrays.asList(new OrderedAva(0, "cn", "bar", "bar "),
                        new OrderedAva(1, "0.1.2.3", "#0c023337", "#0c023337"))));

        List<List<TypeAndValue>> expected = Arrays.asList(
                Arrays.asList(new TypeAndValue("c", "xx")),
                Arrays.asList(new TypeAndValue("cn", "bar"), new TypeAndValue("0.1.2.3", "#0c023337")));
        assertEquals(expected, renderer.render(name));
    }

    @Test
    public void testAgreesWithCanonicalForm() {
        OrderedName name = new OrderedName(Arrays.asList(
                Arrays.asList(new OrderedAva(0, "ou", "b", "B")),
                Arrays.asList(new OrderedAva(0, "cn", "a", "a"), new OrderedAva(0, "cn", "c", " C"))));

        StringBuilder sb = new StringBuilder();
        for (List<TypeAndValue> rdn : renderer.render(name)) {
            if (sb.length() > 0) {
                sb.append(',');
            }
            for (int i = 0; i < rdn.size(); i++) {
                if (i > 0) {
                    sb.append('+');
                }
                sb.append(rdn.get(i).getType()).append('=').append(rdn.get(i).getValue());
            }
        }
        assertEquals(new CanonicalNameRenderer().render(name), sb.toString());
    }
}
