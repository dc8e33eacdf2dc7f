package inferline.registry;

/**
 * 등록된 적 없거나 TTL 이 지나 만료된 프로바이더.
 */
public class ProviderNotFoundException extends RuntimeException {

  private final String providerId;

  public ProviderNotFoundException(String providerId) {
    super("provider not found: " + providerId);
    this.providerId = providerId;
  }

  public String getProviderId() {
    return providerId;
  }
}
