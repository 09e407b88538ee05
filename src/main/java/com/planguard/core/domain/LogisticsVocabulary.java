package com.planguard.core.domain;

import com.planguard.core.domain.ActionSignature.Slot;

import java.util.Map;
import java.util.Optional;

/**
 * Logistics: trucks within a city, airplanes between airports.
 */
public final class LogisticsVocabulary extends AliasingVocabulary {

    static final LogisticsVocabulary INSTANCE = new LogisticsVocabulary();

    private static final Map<String, String> NAMES = Map.of(
            "loadtruck",      "load-truck",
            "unloadtruck",    "unload-truck",
            "loadairplane",   "load-airplane",
            "unloadairplane", "unload-airplane",
            "drivetruck",     "drive-truck",
            "flyairplane",    "fly-airplane"
    );

    private LogisticsVocabulary() {
        Slot obj      = new Slot("obj", "obj", "object", "package", "pkg", "p", "item", "package_name", "obj_name");
        Slot truck    = new Slot("truck", "truck", "vehicle", "t", "truck_name", "veh");
        Slot airplane = new Slot("airplane", "airplane", "plane", "a", "airplane_name", "aircraft");
        Slot loc      = new Slot("loc", "loc", "location", "l", "at", "place", "loc_name", "location_name");
        Slot from     = new Slot("from", "from", "source", "origin", "loc_from", "from_loc", "start");
        Slot to       = new Slot("to", "to", "dest", "destination", "target", "loc_to", "to_loc", "end");
        Slot city     = new Slot("city", "city", "c", "city_name");

        register(new ActionSignature("load-truck", obj, truck, loc));
        register(new ActionSignature("unload-truck", obj, truck, loc));
        register(new ActionSignature("load-airplane", obj, airplane, loc));
        register(new ActionSignature("unload-airplane", obj, airplane, loc));
        register(new ActionSignature("drive-truck", truck, from, to, city));
        register(new ActionSignature("fly-airplane", airplane, from, to));
    }

    @Override
    public PlanningDomain domain() {
        return PlanningDomain.LOGISTICS;
    }

    @Override
    public Optional<String> canonicalName(String actionType) {
        return Optional.ofNullable(NAMES.get(squash(actionType)));
    }
}
