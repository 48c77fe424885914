/**
 * Pure stripe-level work: averaging cells, painting stripes and landing them.
 */
package fr.lapetina.pixelator.processing;
