package telemetry;

/**
 * Capability of an error that knows which component raised it and how it is categorized.
 *
 * @see ErrorEvents#from(Throwable, String)
 */
public interface ComponentAware {

  /**
   * Returns the name of the component that raised the error, e.g. {@code "datastore"}.
   */
  String component();

  /**
   * Returns the category wire value; defaults to {@link ErrorCategory#GENERIC}.
   */
  default String category() {
    return ErrorCategory.GENERIC.value();
  }
}
