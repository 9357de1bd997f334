package org.learningjava.assessrec.domain.policy;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.learningjava.assessrec.domain.model.query.Domain;

import java.util.ArrayList;
import java.util.List;

public class DomainRule {

    @JsonProperty("domain")
    private Domain domain;

    @JsonProperty("testTypes")
    private List<String> testTypes = new ArrayList<>();

    @JsonProperty("keywords")
    private List<String> keywords = new ArrayList<>();

    public Domain getDomain() {
        return domain;
    }

    public void setDomain(Domain domain) {
        this.domain = domain;
    }

    public List<String> getTestTypes() {
        return testTypes;
    }

    public void setTestTypes(List<String> testTypes) {
        this.testTypes = testTypes;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public void setKeywords(List<String> keywords) {
        this.keywords = keywords;
    }
}
