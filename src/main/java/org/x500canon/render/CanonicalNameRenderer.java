package org.x500canon.render;

import java.util.List;

import org.x500canon.name.OrderedAva;
import org.x500canon.name.OrderedName;

/**
 * Renders the canonical form used to compare names for equality, for example
 * <tt>c=xx,ou=b,cn=bar+cn=foo,ou=a</tt>.
 */
public final class CanonicalNameRenderer implements NameRenderer<String> {

    @Override
    public String render(OrderedName name) {
        StringBuilder sb = new StringBuilder();
        List<List<OrderedAva>> rdns = name.getRdns();
        for (int i = 0; i < rdns.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            List<OrderedAva> avas = rdns.get(i);
            for (int j = 0; j < avas.size(); j++) {
                if (j > 0) {
                    sb.append('+');
                }
                OrderedAva ava = avas.get(j);
                sb.append(ava.getType()).append('=').append(ava.getNormalizedValue());
            }
        }
        return sb.toString();
    }
}
