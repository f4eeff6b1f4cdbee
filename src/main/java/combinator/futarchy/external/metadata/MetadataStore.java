package combinator.futarchy.external.metadata;

import java.util.Optional;

/** 콘텐츠 주소 저장소 */
public interface MetadataStore {

  /** @return 콘텐츠 참조 (같은 blob은 같은 참조) */
  String publish(byte[] blob);

  Optional<byte[]> fetch(String reference);
}
