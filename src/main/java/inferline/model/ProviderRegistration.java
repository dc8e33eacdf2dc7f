package inferline.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.Set;

/**
 * 프로바이더 등록 / 폴링 본문.
 */
public class ProviderRegistration {

  private static final String DEFAULT_REQUEST_TYPE = "completion";

  @NotBlank
  @Size(max = 128)
  private String providerId;

  @NotEmpty
  private Set<String> supportedModels;

  /**
   * 비어 있으면 completion 만 처리한다고 본다.
   */
  private Set<String> supportedRequestTypes;

  public ProviderCapabilities toCapabilities() {
    Set<String> types = supportedRequestTypes == null || supportedRequestTypes.isEmpty()
        ? Set.of(DEFAULT_REQUEST_TYPE)
        : supportedRequestTypes;
    return new ProviderCapabilities(providerId, supportedModels, types, null);
  }

  public String getProviderId() {
    return providerId;
  }

  public void setProviderId(String providerId) {
    this.providerId = providerId;
  }

  public Set<String> getSupportedModels() {
    return supportedModels;
  }

  public void setSupportedModels(Set<String> supportedModels) {
    this.supportedModels = supportedModels;
  }

  public Set<String> getSupportedRequestTypes() {
    return supportedRequestTypes;
  }

  public void setSupportedRequestTypes(Set<String> supportedRequestTypes) {
    this.supportedRequestTypes = supportedRequestTypes;
  }
}
