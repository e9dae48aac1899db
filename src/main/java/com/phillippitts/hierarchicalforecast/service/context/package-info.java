/**
 * Shared numeric context of a reconciliation call: restricted aggregation matrix, historical
 * matrix, bottom and tag positions, and the row layouts used to pivot long tables.
 */
package com.phillippitts.hierarchicalforecast.service.context;
