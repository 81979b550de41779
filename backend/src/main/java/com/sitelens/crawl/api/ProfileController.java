package com.sitelens.crawl.api;

import com.sitelens.crawl.model.ExtractionMode;
import com.sitelens.crawl.model.ProfileStats;
import com.sitelens.crawl.model.SiteProfile;
import com.sitelens.crawl.service.SiteProfileService;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api/profiles")
public class ProfileController {
    private final SiteProfileService profileService;

    public ProfileController(SiteProfileService profileService) {
        this.profileService = profileService;
    }

    @GetMapping
    public List<SiteProfile> list(@RequestParam(name = "mode", required = false) String mode) {
        if (mode == null || mode.isBlank()) {
            return profileService.getAll();
        }
        return profileService.getByMode(ExtractionMode.parse(mode));
    }

    @GetMapping("/stats")
    public ProfileStats stats() {
        return profileService.stats();
    }

    @DeleteMapping
    public Map<String, Object> clearAll() {
        int removed = profileService.clearAll();
        return Map.of("deleted", removed);
    }

    @GetMapping("/{id}")
    public SiteProfile get(@PathVariable("id") String id) {
        SiteProfile profile = profileService.getById(id);
        if (profile == null) {
            throw new ResponseStatusException(NOT_FOUND, "Profile not found: " + id);
        }
        return profile;
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> delete(@PathVariable("id") String id) {
        if (!profileService.delete(id)) {
            throw new ResponseStatusException(NOT_FOUND, "Profile not found: " + id);
        }
        return Map.of("deleted", 1, "id", id);
    }

    @GetMapping("/domain/{domain}")
    public SiteProfile byDomain(@PathVariable("domain") String domain) {
        SiteProfile profile = profileService.getByDomain(domain);
        if (profile == null) {
            throw new ResponseStatusException(NOT_FOUND, "No profile for domain: " + domain);
        }
        return profile;
    }

    @PostMapping("/{id}/feedback")
    public SiteProfile feedback(
        @PathVariable("id") String id,
        @RequestParam(name = "success") boolean success
    ) {
        SiteProfile updated = profileService.recordFeedback(id, success);
        if (updated == null) {
            throw new ResponseStatusException(NOT_FOUND, "Profile not found: " + id);
        }
        return updated;
    }
}
