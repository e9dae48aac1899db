/**
 * Prediction-interval helpers: column naming and Gaussian scale recovery.
 */
package com.phillippitts.hierarchicalforecast.service.interval;
