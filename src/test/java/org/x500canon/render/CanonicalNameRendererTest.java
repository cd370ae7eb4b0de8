package org.x500canon.render;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;
import org.x500canon.name.OrderedAva;
import org.x500canon.name.OrderedName;

public class CanonicalNameRendererTest {
    private final CanonicalNameRenderer renderer = new CanonicalNameRenderer();

    @Test
    public void testJoinsPairsWithPlusAndRdnsWithComma() {
        OrderedName name = new OrderedName(Arrays.asList(
                Arrays.asList(new OrderedAva(0, "c", "xx", "XX")),
                Arrays.asList(new OrderedAva(0, "cn", "bar", "bar "),
                        new OrderedAva(0, "cn", "foo", " Foo")),
                Arrays.asList(new OrderedAva(1, "1.2.3", "#0500", "#0500"))));

        assertEquals("c=xx,cn=bar+cn=foo,1.2.3=#0500", renderer.render(name));
    }

    @Test
    public void testEmptyName() {
        assertEquals("", renderer.render(new OrderedName(Collections.<List<OrderedAva>>emptyList())));
    }

    @Test
    public void testEmptyValue() {
        OrderedName name = new OrderedName(Collections.singletonList(
                Arrays.asList(new OrderedAva(0, "cn", "", "   "))));

        assertEquals("cn=", renderer.render(name));
    }
}
