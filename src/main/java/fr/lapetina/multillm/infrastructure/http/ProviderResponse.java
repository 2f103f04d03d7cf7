package fr.lapetina.multillm.infrastructure.http;

/**
 * Raw HTTP answer from a provider.
 */
public record ProviderResponse(int statusCode, String body) {

    public ProviderResponse {
        if (body == null) {
            body = "";
        }
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
