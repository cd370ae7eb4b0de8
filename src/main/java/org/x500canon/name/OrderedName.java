package org.x500canon.name;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * A distinguished name in canonical order.
 * <p>
 * The relative distinguished names are in reverse encoding order, and the
 * pairs within each of them are sorted. Instances are immutable.
 */
public final class OrderedName implements Iterable<List<OrderedAva>> {
    private final List<List<OrderedAva>> rdns;

    public OrderedName(List<List<OrderedAva>> rdns) {
        if (rdns == null) {
            throw new NullPointerException("rdns must not be null");
        }
        List<List<OrderedAva>> copy = new ArrayList<List<OrderedAva>>(rdns.size());
        for (List<OrderedAva> rdn : rdns) {
            copy.add(Collections.unmodifiableList(new ArrayList<OrderedAva>(rdn)));
        }
        this.rdns = Collections.unmodifiableList(copy);
    }

    /**
     * Returns the ordered relative distinguished names.
     *
     * @return an unmodifiable list of unmodifiable lists.
     */
    public List<List<OrderedAva>> getRdns() {
        return rdns;
    }

    public int size() {
        return rdns.size();
    }

    public boolean isEmpty() {
        return rdns.isEmpty();
    }

    @Override
    public Iterator<List<OrderedAva>> iterator() {
        return rdns.iterator();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof OrderedName)) {
            return false;
        }
        return rdns.equals(((OrderedName) obj).rdns);
    }

    @Override
    public int hashCode() {
        return rdns.hashCode();
    }

    @Override
    public String toString() {
        return rdns.toString();
    }
}
