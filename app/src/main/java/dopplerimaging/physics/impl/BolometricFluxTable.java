package dopplerimaging.physics.impl;

import dopplerimaging.physics.i.IRadiationLaw;

/**
 * Tabla de flujo bolométrico: la radiancia total de cada temperatura escalada por
 * cada fracción de área. Fila = fracción, columna = temperatura.
 */
public final class BolometricFluxTable {

    /**
     * Prohibido construir esta clase utilidad
     */
    private BolometricFluxTable() {
    }

    public static double[][] compute(IRadiationLaw law, double[] temperatures, double[] fractions) {
        double[] totals = new double[temperatures.length];
        for (int t = 0; t < temperatures.length; t++) {
            totals[t] = law.totalRadiance(temperatures[t]);
        }
        double[][] table = new double[fractions.length][temperatures.length];
        for (int f = 0; f < fractions.length; f++) {
            for (int t = 0; t < temperatures.length; t++) {
                table[f][t] = totals[t] * fractions[f];
            }
        }
        return table;
    }
}
