package org.transitmatters.stopevents.processing;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class ProcessorUtils {
    private ProcessorUtils() {}

    // Green Line branches are separate routes in GTFS: Green-B, Green-C, Green-D and Green-E
    static final String GREEN_BRANCH_ROUTE_REGEX = "^(Green)-([BCDE])$";
    static final Pattern GREEN_BRANCH_ROUTE_PATTERN = Pattern.compile(GREEN_BRANCH_ROUTE_REGEX);

    public static boolean isBranchRoute(String routeId) {
        if (routeId == null) {
            return false;
        }
        Matcher matcher = GREEN_BRANCH_ROUTE_PATTERN.matcher(routeId);
        return matcher.matches();
    }

    /**
     * @return the trunk a route belongs to, the route itself if it has no branches
     */
    public static String trunkRouteId(String routeId) {
        if (routeId == null) {
            return null;
        }
        Matcher matcher = GREEN_BRANCH_ROUTE_PATTERN.matcher(routeId);
        if (matcher.matches()) {
            return matcher.group(1);
        }
        return routeId;
    }

    /**
     * @return the branch a route id denotes, empty for routes without branches
     */
    public static Optional<String> branchRouteId(String routeId) {
        return isBranchRoute(routeId) ? Optional.of(routeId) : Optional.empty();
    }
}
