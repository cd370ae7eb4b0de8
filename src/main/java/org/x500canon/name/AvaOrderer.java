package org.x500canon.name;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Orders the attribute type and value pairs of one relative distinguished
 * name.
 * <p>
 * Pairs are sorted by OID flag, so that standard types come first, then by
 * type label and then by normalized value. The sort is stable: pairs with
 * equal keys keep their encoding order.
 */
public final class AvaOrderer {
    private static final Comparator<OrderedAva> LEXICOGRAPHIC = new Comparator<OrderedAva>() {
        @Override
        public int compare(OrderedAva a, OrderedAva b) {
            int result = compareFlags(a, b);
            if (result == 0) {
                result = a.getType().compareTo(b.getType());
            }
            if (result == 0) {
                result = a.getNormalizedValue().compareTo(b.getNormalizedValue());
            }
            return result;
        }
    };

    private static final Comparator<OrderedAva> NUMERIC = new Comparator<OrderedAva>() {
        @Override
        public int compare(OrderedAva a, OrderedAva b) {
            int result = compareFlags(a, b);
            if (result == 0) {
                if (a.isStandardType()) {
                    result = a.getType().compareTo(b.getType());
                } else {
                    result = compareArcs(a.getType(), b.getType());
                }
            }
            if (result == 0) {
                result = a.getNormalizedValue().compareTo(b.getNormalizedValue());
            }
            return result;
        }
    };

    private final Comparator<OrderedAva> comparator;

    public AvaOrderer(OidOrdering ordering) {
        this.comparator = comparator(ordering);
    }

    /**
     * Returns the comparator for the given ordering.
     *
     * @param ordering
     *            the OID ordering.
     * @return the comparator.
     */
    public static Comparator<OrderedAva> comparator(OidOrdering ordering) {
        if (ordering == null) {
            throw new NullPointerException("ordering must not be null");
        }
        switch (ordering) {
        case NUMERIC:
            return NUMERIC;
        case LEXICOGRAPHIC:
            return LEXICOGRAPHIC;
        default:
            throw new IllegalArgumentException("Unknown ordering: " + ordering);
        }
    }

    /**
     * Sorts the given pairs.
     *
     * @param avas
     *            the pairs of one relative distinguished name.
     * @return a new list holding the pairs in ascending order.
     */
    public List<OrderedAva> order(Collection<OrderedAva> avas) {
        List<OrderedAva> sorted = new ArrayList<OrderedAva>(avas);
        Collections.sort(sorted, comparator);
        return sorted;
    }

    private static int compareFlags(OrderedAva a, OrderedAva b) {
        return a.getOidFlag() < b.getOidFlag() ? -1 : (a.getOidFlag() == b.getOidFlag() ? 0 : 1);
    }

    /**
     * Compares two dotted OIDs arc by arc. An OID which is a prefix of the
     * other sorts first.
     */
    static int compareArcs(String a, String b) {
        String[] arcsA = a.split("\\.");
        String[] arcsB = b.split("\\.");
        int n = Math.min(arcsA.length, arcsB.length);
        for (int i = 0; i < n; i++) {
            int result = new BigInteger(arcsA[i]).compareTo(new BigInteger(arcsB[i]));
            if (result != 0) {
                return result;
            }
        }
        return arcsA.length - arcsB.length;
    }
}
