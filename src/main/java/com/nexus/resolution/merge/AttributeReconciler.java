package com.nexus.resolution.merge;

import com.nexus.resolution.core.model.AttributeConflict;
import com.nexus.resolution.core.model.AttributeProvenance;
import com.nexus.resolution.core.model.CanonicalEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Folds incoming attributes into a canonical under an {@link AttributePolicy}:
 * <ul>
 *   <li>multi-valued: set union, order of first observation kept</li>
 *   <li>single-valued: most recent observation wins, the prior value goes to provenance</li>
 *   <li>required and disagreeing: the existing value stays and the disagreement is recorded
 *       as an {@link AttributeConflict}</li>
 * </ul>
 */
public class AttributeReconciler {
    private static final Logger log = LoggerFactory.getLogger(AttributeReconciler.class);

    private final AttributePolicy policy;

    public AttributeReconciler(AttributePolicy policy) {
        this.policy = policy;
    }

    /**
     * @param source where the incoming values came from, recorded in provenance and conflicts
     * @return conflicts flagged by this call
     */
    public List<AttributeConflict> reconcile(CanonicalEntity target, Map<String, Object> incoming, String source) {
        List<AttributeConflict> conflicts = new ArrayList<>();
        for (Map.Entry<String, Object> entry : incoming.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            Object existing = target.getAttribute(key);

            if (policy.isMultiValued(key)) {
                List<Object> union = union(existing, value);
                if (!union.equals(asList(existing))) {
                    target.putAttribute(key, union);
                    target.addProvenance(AttributeProvenance.of(key, existing, union, source));
                }
            } else if (existing == null) {
                target.putAttribute(key, value);
                target.addProvenance(AttributeProvenance.of(key, null, value, source));
            } else if (!Objects.equals(existing, value)) {
                if (policy.isRequired(key)) {
                    AttributeConflict conflict = AttributeConflict.of(key, existing, value, source);
                    target.addConflict(conflict);
                    conflicts.add(conflict);
                    log.warn("merge.attribute_conflict canonicalId={} attribute={} source={}",
                            target.getId(), key, source);
                } else {
                    target.putAttribute(key, value);
                    target.addProvenance(AttributeProvenance.of(key, existing, value, source));
                }
            }
        }
        return conflicts;
    }

    public AttributePolicy getPolicy() {
        return policy;
    }

    private static List<Object> union(Object existing, Object incoming) {
        Set<Object> values = new LinkedHashSet<>(asList(existing));
        values.addAll(asList(incoming));
        return new ArrayList<>(values);
    }

    private static List<Object> asList(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        return List.of(value);
    }
}
