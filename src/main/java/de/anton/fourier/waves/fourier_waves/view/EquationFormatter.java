package de.anton.fourier.waves.fourier_waves.view;

import de.anton.fourier.waves.fourier_waves.model.Domain;
import de.anton.fourier.waves.fourier_waves.model.EquationForm;
import de.anton.fourier.waves.fourier_waves.model.SeriesType;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
import java.util.Objects;

/**
 * Formats the equations of a Fourier series as plain text, e.g. "A_n sin(2πx/λ_n)".
 * Subscripts are written with an underscore.
 */
public final class EquationFormatter {

    public static final String ORDER_SYMBOL = "n";
    public static final String AMPLITUDE_SYMBOL = "A_n";

    private static final String PI = "π";
    private static final String LAMBDA = "λ";
    private static final String OMEGA = "ω";
    private static final String MINUS = "−";

    private static final DecimalFormat AMPLITUDE_FORMAT = new DecimalFormat("0.##", DecimalFormatSymbols.getInstance(Locale.ROOT));

    private EquationFormatter() {
        throw new IllegalStateException("Utility class");
    }

    /** The general form of one term, in symbols. HIDDEN gives an empty string. */
    public static String getGeneralForm(Domain domain, SeriesType seriesType, EquationForm equationForm) {
        return format(domain, seriesType, equationForm, ORDER_SYMBOL, AMPLITUDE_SYMBOL);
    }

    /** The term for one harmonic, with its order and amplitude filled in. */
    public static String getSpecificForm(Domain domain, SeriesType seriesType, EquationForm equationForm,
                                         int order, double amplitude) {
        if (order < 1) {
            throw new IllegalArgumentException("Order must be >= 1. Got: " + order);
        }
        return format(domain, seriesType, equationForm, String.valueOf(order), formatAmplitude(amplitude));
    }

    /** The left-hand side of the sum equation, e.g. "F(x,t)". */
    public static String getFunctionOf(Domain domain) {
        return Objects.requireNonNull(domain, "Domain cannot be null").getFunctionOf();
    }

    /** The term drawn above the components of a wave packet: "A_n sin(k_n x)" or "A_n cos(ω_n t)". */
    public static String getComponentsEquation(Domain domain, SeriesType seriesType) {
        Objects.requireNonNull(seriesType, "SeriesType cannot be null");
        if (domain == Domain.SPACE) {
            return AMPLITUDE_SYMBOL + " " + seriesType.getSymbol() + "(k_n x)";
        } else if (domain == Domain.TIME) {
            return AMPLITUDE_SYMBOL + " " + seriesType.getSymbol() + "(" + OMEGA + "_n t)";
        }
        throw new IllegalArgumentException("Components equation exists for SPACE and TIME only. Got: " + domain);
    }

    static String formatAmplitude(double amplitude) {
        synchronized (AMPLITUDE_FORMAT) {
            String text = AMPLITUDE_FORMAT.format(amplitude);
            return "-0".equals(text) ? "0" : text;
        }
    }

    private static String format(Domain domain, SeriesType seriesType, EquationForm equationForm, String order, String amplitude) {
        Objects.requireNonNull(domain, "Domain cannot be null");
        Objects.requireNonNull(seriesType, "SeriesType cannot be null");
        Objects.requireNonNull(equationForm, "EquationForm cannot be null");
        if (!equationForm.supports(domain)) {
            throw new IllegalArgumentException("Equation form " + equationForm + " is not supported for domain " + domain);
        }
        if (equationForm == EquationForm.HIDDEN) {
            return "";
        }
        String argument;
        switch (equationForm) {
            case WAVELENGTH:
                argument = "2" + PI + "x/" + LAMBDA + "_" + order;
                break;
            case SPATIAL_WAVE_NUMBER:
                argument = "k_" + order + " x";
                break;
            case FREQUENCY:
                argument = "2" + PI + "f_" + order + " t";
                break;
            case PERIOD:
                argument = "2" + PI + "t/T_" + order;
                break;
            case ANGULAR_WAVE_NUMBER:
                argument = OMEGA + "_" + order + " t";
                break;
            case WAVELENGTH_AND_PERIOD:
                argument = "2" + PI + "(x/" + LAMBDA + "_" + order + " " + MINUS + " t/T_" + order + ")";
                break;
            case SPATIAL_WAVE_NUMBER_AND_ANGULAR_WAVE_NUMBER:
                argument = "k_" + order + " x " + MINUS + " " + OMEGA + "_" + order + " t";
                break;
            case MODE:
                argument = getModeArgument(domain, order);
                break;
            default:
                throw new IllegalArgumentException("Unsupported equation form: " + equationForm);
        }
        return amplitude + " " + seriesType.getSymbol() + "(" + argument + ")";
    }

    private static String getModeArgument(Domain domain, String order) {
        if (domain == Domain.SPACE) {
            return "2" + PI + order + "x/L";
        } else if (domain == Domain.TIME) {
            return "2" + PI + order + "t/T";
        }
        return "2" + PI + order + "(x/L " + MINUS + " t/T)";
    }
}
