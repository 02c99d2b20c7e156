package beamanalyzer.domain.diagram;

/**
 * Aviso no fatal adjunto al resultado. Nunca se lanza; el llamante decide si lo trata como error.
 */
public record NumericalWarning(WarningType type, String message) {
}
