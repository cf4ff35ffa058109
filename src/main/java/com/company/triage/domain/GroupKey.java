package com.company.triage.domain;

import lombok.Value;

/**
 * Origin of an alert: the (service, component) pair.
 */
@Value
public class GroupKey {
    String service;
    String component;

    @Override
    public String toString() {
        return service + "/" + component;
    }
}
