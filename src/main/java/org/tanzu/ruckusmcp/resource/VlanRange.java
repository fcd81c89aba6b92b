package org.tanzu.ruckusmcp.resource;

import org.tanzu.ruckusmcp.exception.ValidationException;

final class VlanRange {

    static final int MIN = 1;
    static final int MAX = 4094;

    private VlanRange() {
    }

    static void check(int vlan) {
        if (vlan < MIN || vlan > MAX) {
            throw new ValidationException("VLAN must be between " + MIN + " and " + MAX + ", got " + vlan);
        }
    }
}
