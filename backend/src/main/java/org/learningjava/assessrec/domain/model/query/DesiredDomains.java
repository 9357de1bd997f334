package org.learningjava.assessrec.domain.model.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Which domains the request text asks for. Independent flags: any combination is valid.
 */
public record DesiredDomains(boolean technical, boolean behavioral, boolean cognitive) {

    public static final DesiredDomains NONE = new DesiredDomains(false, false, false);

    public boolean any() {
        return technical || behavioral || cognitive;
    }

    public int count() {
        return (technical ? 1 : 0) + (behavioral ? 1 : 0) + (cognitive ? 1 : 0);
    }

    /** Desired domains in allocation priority order: technical, behavioral, cognitive. */
    public List<Domain> inPriorityOrder() {
        List<Domain> out = new ArrayList<>(3);
        if (technical) out.add(Domain.TECHNICAL);
        if (behavioral) out.add(Domain.BEHAVIORAL);
        if (cognitive) out.add(Domain.COGNITIVE);
        return out;
    }
}
