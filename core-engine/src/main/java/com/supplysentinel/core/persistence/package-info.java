/**
 * Whole-state persistence of an ensemble as a single JSON bundle.
 */
package com.supplysentinel.core.persistence;
