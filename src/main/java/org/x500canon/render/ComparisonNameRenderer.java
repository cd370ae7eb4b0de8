package org.x500canon.render;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.x500canon.name.OrderedAva;
import org.x500canon.name.OrderedName;

/**
 * Renders the canonical form as nested lists of {@link TypeAndValue}, with
 * the same order and values as {@link CanonicalNameRenderer}.
 */
public final class ComparisonNameRenderer implements NameRenderer<List<List<TypeAndValue>>> {

    @Override
    public List<List<TypeAndValue>> render(OrderedName name) {
        List<List<TypeAndValue>> rdns = new ArrayList<List<TypeAndValue>>(name.size());
        for (List<OrderedAva> rdn : name) {
            List<TypeAndValue> avas = new ArrayList<TypeAndValue>(rdn.size());
            for (OrderedAva ava : rdn) {
                avas.add(new TypeAndValue(ava.getType(), ava.getNormalizedValue()));
            }
            rdns.add(Collections.unmodifiableList(avas));
        }
        return Collections.unmodifiableList(rdns);
    }
}
