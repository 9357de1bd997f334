package org.learningjava.assessrec.domain.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public class DomainConfig {

    @JsonProperty("domains")
    private List<DomainRule> domains = new ArrayList<>();

    public List<DomainRule> getDomains() {
        return domains;
    }

    public void setDomains(List<DomainRule> domains) {
        this.domains = domains;
    }
}
