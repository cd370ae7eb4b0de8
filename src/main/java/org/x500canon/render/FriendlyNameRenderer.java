package org.x500canon.render;

import java.util.List;
import java.util.Locale;

import org.x500canon.name.OrderedAva;
import org.x500canon.name.OrderedName;
import org.x500canon.util.DebugStrings;

/**
 * Renders a form for people to read, for example
 * <tt>C=xx, OU=b, CN=bar +CN= Foo, OU=a</tt>.
 * <p>
 * The order is canonical, but values are the raw values with non-printable
 * characters escaped by {@link DebugStrings#escape(String)}. Two names which
 * compare equal may have different friendly forms.
 */
public final class FriendlyNameRenderer implements NameRenderer<String> {

    @Override
    public String render(OrderedName name) {
        StringBuilder sb = new StringBuilder();
        List<List<OrderedAva>> rdns = name.getRdns();
        for (int i = 0; i < rdns.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            List<OrderedAva> avas = rdns.get(i);
            for (int j = 0; j < avas.size(); j++) {
                if (j > 0) {
                    sb.append('+');
                }
                OrderedAva ava = avas.get(j);
                sb.append(ava.getType().toUpperCase(Locale.US))
                        .append('=')
                        .append(DebugStrings.escape(ava.getRawValue()));
            }
        }
        return sb.toString();
    }
}
