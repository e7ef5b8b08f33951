package my.hrddrisk.app.catalog;

public class CountryCatalogUnavailableException extends RuntimeException {
	public CountryCatalogUnavailableException(String message) {
		super(message);
	}

	public CountryCatalogUnavailableException(String message, Throwable cause) {
		super(message, cause);
	}
}
