package com.incidentmigrator.migrator.infrastructure.configfile;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Header object users sometimes paste instead of a bare token.
 */
record AuthorizationHeader(@JsonProperty("Authorization") String authorization) {}
