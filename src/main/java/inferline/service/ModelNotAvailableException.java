package inferline.service;

/**
 * 활성 프로바이더 중 누구도 처리하지 않는 모델.
 */
public class ModelNotAvailableException extends RuntimeException {

  private final String model;

  public ModelNotAvailableException(String model) {
    super("Model '" + model + "' not found");
    this.model = model;
  }

  public String getModel() {
    return model;
  }
}
