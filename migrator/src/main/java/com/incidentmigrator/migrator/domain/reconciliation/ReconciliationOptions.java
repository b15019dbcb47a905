package com.incidentmigrator.migrator.domain.reconciliation;

import com.incidentmigrator.migrator.domain.monitor.AlertFilter;
import lombok.Builder;

/**
 * @param simulate dry run: compute every change, create and update nothing
 * @param verbose  also report unchanged monitors with their reason
 */
@Builder(toBuilder = true)
public record ReconciliationOptions(boolean simulate, boolean verbose, AlertFilter filter) {

    public ReconciliationOptions {
        filter = filter == null ? AlertFilter.none() : filter;
    }
}
