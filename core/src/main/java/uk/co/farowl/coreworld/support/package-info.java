/**
 * The {@code support} package contains the exceptions through which the
 * kernel reports malformed input and internal failure. Outcomes of
 * reduction and verification, including running out of fuel, are not
 * exceptions: they are values in {@code reduce} and {@code proof}.
 */
package uk.co.farowl.coreworld.support;
