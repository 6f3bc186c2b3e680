package com.mouse.keeper.config;

import com.mouse.keeper.model.Site;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * The configured sites in failover order: the primary first, then backups by ascending priority.
 */
@Component
public class SiteCatalog {

    private final Site primary;
    private final List<Site> backups;
    private final List<Site> failoverOrder;

    @Autowired
    public SiteCatalog(KeeperProperties properties) {
        this(properties.getSites().stream().map(SiteCatalog::toSite).toList());
    }

    public SiteCatalog(List<Site> sites) {
        this.primary = sites.stream()
                .filter(Site::isPrimary)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No primary site configured"));
        this.backups = sites.stream()
                .filter(s -> !s.isPrimary())
                .sorted(Comparator.comparingInt(Site::getPriority))
                .toList();

        List<Site> ordered = new ArrayList<>();
        ordered.add(primary);
        ordered.addAll(backups);
        this.failoverOrder = List.copyOf(ordered);
    }

    public Site primary() {
        return primary;
    }

    public List<Site> backups() {
        return backups;
    }

    /** Index 0 is the primary, index i is backup i - 1. */
    public Site at(int index) {
        return failoverOrder.get(index);
    }

    public int size() {
        return failoverOrder.size();
    }

    public List<Site> inFailoverOrder() {
        return failoverOrder;
    }

    private static Site toSite(KeeperProperties.SiteProperties props) {
        return Site.builder()
                .name(props.getName())
                .url(props.getUrl())
                .role(props.getRole())
                .requiresProxy(props.isRequiresProxy())
                .requiresChallenge(props.isRequiresChallenge())
                .priority(props.getPriority())
                .challengePath(props.getChallengePath())
                .build();
    }
}
