/**
 * Probe and activity model, storage ports and the segmentation, aggregation and export logic.
 * Nothing in this package depends on Spring; the application layer wires it together.
 */
package com.bko.biketracker.tracking.domain;
