/**
 * YAML configuration of the ensemble: policy, calibration options and the
 * detector roster.
 */
package com.supplysentinel.core.config;
