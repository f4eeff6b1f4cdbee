package combinator.futarchy.external.metadata;

import combinator.futarchy.domain.proposal.ProposalMetadata;
import combinator.futarchy.global.executor.LogicExecutor;
import combinator.futarchy.global.executor.TaskContext;
import combinator.futarchy.global.executor.strategy.ExceptionTranslator;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** 제안 메타데이터 JSON 직렬화 */
@Component
@RequiredArgsConstructor
public class ProposalMetadataCodec {

  private final ObjectMapper objectMapper;
  private final LogicExecutor executor;

  public byte[] encode(ProposalMetadata metadata) {
    return executor.executeWithTranslation(
        () -> objectMapper.writeValueAsBytes(metadata),
        ExceptionTranslator.forJson(),
        TaskContext.of("Metadata", "encode", metadata.organizationAddress()));
  }

  public ProposalMetadata decode(byte[] blob, String reference) {
    return executor.executeWithTranslation(
        () -> objectMapper.readValue(blob, ProposalMetadata.class),
        ExceptionTranslator.forJson(),
        TaskContext.of("Metadata", "decode", reference));
  }
}
