package com.nexus.resolution.adjudication;

import com.nexus.resolution.core.model.Alias;
import com.nexus.resolution.core.model.CandidateEntity;
import com.nexus.resolution.core.model.CanonicalEntity;

import java.util.List;
import java.util.Map;

/**
 * What the adjudicator sees of one entity: name, type, aliases and attributes.
 *
 * @param id canonical id for contenders, ingestion id for the candidate
 */
public record CandidateProfile(
        String id,
        String name,
        String type,
        List<String> aliases,
        Map<String, Object> attributes
) {
    public CandidateProfile {
        aliases = aliases != null ? List.copyOf(aliases) : List.of();
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    public static CandidateProfile of(CandidateEntity candidate) {
        return new CandidateProfile(candidate.ingestionId(), candidate.name(), candidate.type().getLabel(),
                List.of(), candidate.attributes());
    }

    public static CandidateProfile of(CanonicalEntity canonical) {
        List<String> aliases = canonical.getAliases().stream()
                .map(Alias::text)
                .filter(text -> !text.equals(canonical.getPrimaryName()))
                .toList();
        return new CandidateProfile(canonical.getId(), canonical.getPrimaryName(), canonical.getType().getLabel(),
                aliases, canonical.getAttributes());
    }
}
