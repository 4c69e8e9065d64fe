package com.archivesafrica.mailprocessor.registry;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One registry entry: the short code used in staged filenames, the last sequence number
 * handed out and the preferred report language.
 * <p>
 * An entry without a code only carries a counter and does not register its address.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SenderProfile {

    public String code;
    public Integer sequence;
    public String language;

    public SenderProfile() {}

    public SenderProfile(String code, Integer sequence, String language) {
        this.code = code;
        this.sequence = sequence;
        this.language = language;
    }

    @JsonIgnore
    public boolean isRegistered() {
        return code != null && !code.isBlank();
    }

    @JsonIgnore
    public int currentSequence() {
        return sequence == null ? 0 : sequence;
    }
}
