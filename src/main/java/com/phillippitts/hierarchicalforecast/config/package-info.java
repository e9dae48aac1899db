/**
 * Spring configuration: bound properties, the reconciliation executor and reconciler wiring.
 */
package com.phillippitts.hierarchicalforecast.config;
