/** Recalculation requests sent to the {@link syncengine.spi.CalculationLayer}. */
package syncengine.recalc;
