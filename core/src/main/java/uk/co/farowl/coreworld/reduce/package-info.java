/**
 * The {@code reduce} package contains single-step beta reduction under
 * several strategies and the fuel-bounded normalization driver.
 */
package uk.co.farowl.coreworld.reduce;
