package idlescope.core.service.activity;

import idlescope.core.model.activity.RequestRecord;

/**
 * Marks a request as non-business traffic.
 */
public interface ExclusionRule {

    /**
     * Rule name used as the key of exclusion counts.
     */
    String name();

    boolean excludes(RequestRecord record);
}
