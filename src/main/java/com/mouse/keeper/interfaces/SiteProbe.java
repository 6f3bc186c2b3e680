package com.mouse.keeper.interfaces;

import com.mouse.keeper.model.ProbeResult;
import com.mouse.keeper.model.Site;

/**
 * Lightweight health request against one site. Never throws; failures come back as unhealthy results.
 */
public interface SiteProbe {

    ProbeResult probe(Site site);
}
