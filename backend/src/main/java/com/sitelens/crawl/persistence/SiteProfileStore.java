package com.sitelens.crawl.persistence;

import com.sitelens.crawl.model.ExtractionMode;
import com.sitelens.crawl.model.ProfileStats;
import com.sitelens.crawl.model.SiteProfile;

import java.util.List;

/**
 * Per-domain history of extraction profiles. Lookups return {@code null} when nothing matches.
 */
public interface SiteProfileStore {

    SiteProfile insert(SiteProfile profile);

    SiteProfile findById(String id);

    /**
     * Highest-confidence profile for the domain, most recently used first among equals.
     */
    SiteProfile findByDomain(String domain);

    List<SiteProfile> findAll();

    List<SiteProfile> findByMode(ExtractionMode mode);

    /**
     * Records one use of the profile and folds the outcome into its success rate.
     *
     * @return the updated profile, or {@code null} when the id is unknown
     */
    SiteProfile updateUsage(String id, boolean success);

    boolean delete(String id);

    int clearAll();

    ProfileStats stats();
}
