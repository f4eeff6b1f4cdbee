package combinator.futarchy.domain.proposal;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * 콘텐츠 주소 저장소에 게시되는 제안 메타데이터
 *
 * <p>필드 이름은 기존에 게시된 blob과 호환되어야 하므로 JSON 이름을 고정합니다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProposalMetadata(
    @JsonProperty("title") String title,
    @JsonProperty("description") String description,
    @JsonProperty("options") List<String> options,
    @JsonProperty("dao_pda") String organizationAddress) {

  public ProposalMetadata {
    options = options == null ? List.of() : List.copyOf(options);
  }

  public boolean belongsTo(String address) {
    return organizationAddress != null && organizationAddress.equals(address);
  }
}
