package inferline.model;

import java.util.List;

/**
 * 현재 연결된 프로바이더 기준 모델 목록 (OpenAI list 형식).
 */
public record ModelCatalog(String object, List<Entry> data) {

  public static ModelCatalog of(List<Entry> data) {
    return new ModelCatalog("list", List.copyOf(data));
  }

  public record Entry(String id, String object, String ownedBy, List<String> providers) {

    public static Entry of(String id, List<String> providers) {
      String owner = providers.isEmpty() ? "unknown" : providers.get(0);
      return new Entry(id, "model", owner, List.copyOf(providers));
    }
  }
}
