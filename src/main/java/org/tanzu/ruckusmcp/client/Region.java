package org.tanzu.ruckusmcp.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * RUCKUS One API regions and their hosts.
 */
public enum Region {

    NA("na", "api.ruckus.cloud"),
    EU("eu", "api.eu.ruckus.cloud"),
    ASIA("asia", "api.asia.ruckus.cloud");

    private static final Logger logger = LoggerFactory.getLogger(Region.class);

    private final String code;
    private final String host;

    Region(String code, String host) {
        this.code = code;
        this.host = host;
    }

    public String getCode() { return code; }

    public String getHost() { return host; }

    public String baseUrl() {
        return "https://" + host;
    }

    /**
     * Looks up a region by its code, ignoring case.
     * 
     * Unknown, null or blank codes resolve to {@link #NA}. A warning names the
     * rejected code so a misspelled region shows up in the logs.
     * 
     * @param code region code such as "na", "eu" or "asia"
     * @return the matching region, or NA
     */
    public static Region resolve(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (Region region : values()) {
                if (region.code.equals(normalized)) {
                    return region;
                }
            }
        }
        logger.warn("Unknown RUCKUS One region '{}', falling back to '{}' ({})", code, NA.code, NA.host);
        return NA;
    }
}
