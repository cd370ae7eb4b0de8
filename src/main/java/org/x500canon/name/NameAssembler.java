package org.x500canon.name;

import java.util.ArrayList;
import java.util.List;

import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.x500.AttributeTypeAndValue;
import org.bouncycastle.asn1.x500.RDN;
import org.bouncycastle.asn1.x500.X500Name;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.x500canon.asn1.AttributeValue;
import org.x500canon.oid.StandardAttributeType;

/**
 * Builds the {@link OrderedName} of a decoded distinguished name.
 * <p>
 * The relative distinguished names are reversed, so the most specific one
 * comes first, and the pairs within each of them are sorted by an
 * {@link AvaOrderer}. No pair is dropped or merged.
 */
public final class NameAssembler {
    private static final Logger LOGGER = LoggerFactory.getLogger(NameAssembler.class);

    private final OidOrdering ordering;
    private final AvaOrderer orderer;
    private final ValueNormalizer normalizer = new ValueNormalizer();

    public NameAssembler(OidOrdering ordering) {
        if (ordering == null) {
            throw new NullPointerException("ordering must not be null");
        }
        this.ordering = ordering;
        this.orderer = new AvaOrderer(ordering);
    }

    public OidOrdering getOrdering() {
        return ordering;
    }

    /**
     * Orders the given name.
     *
     * @param name
     *            the decoded name.
     * @return the ordered name, which is empty if the name has no RDNs.
     */
    public OrderedName assemble(X500Name name) {
        if (name == null) {
            throw new NullPointerException("name must not be null");
        }
        RDN[] rdns = name.getRDNs();
        LOGGER.debug("Ordering name with {} RDNs using {} OID ordering", rdns.length, ordering);

        List<List<OrderedAva>> ordered = new ArrayList<List<OrderedAva>>(rdns.length);
        for (int i = rdns.length - 1; i >= 0; i--) {
            AttributeTypeAndValue[] pairs = rdns[i].getTypesAndValues();
            List<OrderedAva> avas = new ArrayList<OrderedAva>(pairs.length);
            for (AttributeTypeAndValue pair : pairs) {
                avas.add(toOrderedAva(pair));
            }
            ordered.add(orderer.order(avas));
        }
        return new OrderedName(ordered);
    }

    private OrderedAva toOrderedAva(AttributeTypeAndValue pair) {
        ASN1ObjectIdentifier oid = pair.getType();
        StandardAttributeType standard = StandardAttributeType.forOid(oid);
        NormalizedValue value = normalizer.convert(AttributeValue.getInstance(oid, pair.getValue()));
        if (standard != null) {
            return new OrderedAva(OrderedAva.STANDARD_TYPE, standard.getAbbreviation(),
                    value.getNormalizedValue(), value.getRawValue());
        }
        return new OrderedAva(OrderedAva.OID_TYPE, oid.getId(),
                value.getNormalizedValue(), value.getRawValue());
    }
}
