package io.flowmie.api;

/**
 * One (diameter, signal) sample of a calibration table.
 *
 * @param diameter particle diameter, nm
 * @param signal   predicted or measured detector signal for that diameter
 */
public record CalibrationPoint(double diameter, double signal) {

    public CalibrationPoint {
        if (!Double.isFinite(diameter)) {
            throw InvalidInputException.invalidParameter("diameter", diameter, "a finite value");
        }
        if (!Double.isFinite(signal)) {
            throw InvalidInputException.invalidParameter("signal", signal, "a finite value");
        }
    }
}
