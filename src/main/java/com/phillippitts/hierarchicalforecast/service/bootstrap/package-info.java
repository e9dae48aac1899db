/**
 * Bootstrap uncertainty: sampled forecast paths for empirical prediction intervals.
 */
package com.phillippitts.hierarchicalforecast.service.bootstrap;
