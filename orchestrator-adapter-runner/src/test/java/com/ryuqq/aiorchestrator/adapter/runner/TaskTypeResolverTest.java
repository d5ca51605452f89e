package com.ryuqq.aiorchestrator.adapter.runner;

import com.ryuqq.aiorchestrator.core.contract.QueryInput;
import com.ryuqq.aiorchestrator.core.contract.QueryRequest;
import com.ryuqq.aiorchestrator.core.exception.SchemaValidationException;
import com.ryuqq.aiorchestrator.core.model.TaskType;
import com.ryuqq.aiorchestrator.core.model.Tier;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskTypeResolverTest {

    private static QueryRequest structured(Map<String, Object> fields) {
        return QueryRequest.builder(new QueryInput.Structured(fields), Tier.ADMIN).build();
    }

    @Test
    void 텍스트_입력은_chat() {
        assertThat(TaskTypeResolver.resolve(QueryRequest.of("hello", Tier.GUEST))).isEqualTo(TaskType.CHAT);
    }

    @Test
    void hint가_있으면_hint_우선() {
        // given
        QueryRequest request = QueryRequest.builder(new QueryInput.Text("2+2?"), Tier.ADMIN)
            .taskType(TaskType.ANALYZE)
            .build();

        // when & then
        assertThat(TaskTypeResolver.resolve(request)).isEqualTo(TaskType.ANALYZE);
    }

    @Test
    void image_필드는_vision() {
        assertThat(TaskTypeResolver.resolve(structured(Map.of("image", "aGVsbG8=", "prompt", "describe"))))
            .isEqualTo(TaskType.VISION);
    }

    @Test
    void code_필드는_code_analysis() {
        assertThat(TaskTypeResolver.resolve(structured(Map.of("code", "class A {}"))))
            .isEqualTo(TaskType.CODE_ANALYSIS);
    }

    @Test
    void features_필드는_classify() {
        assertThat(TaskTypeResolver.resolve(structured(Map.of("features", Map.of("length", 12)))))
            .isEqualTo(TaskType.CLASSIFY);
    }

    @Test
    void 추론할_수_없는_구조화_입력은_거부() {
        assertThatThrownBy(() -> TaskTypeResolver.resolve(structured(Map.of("blob", 1))))
            .isInstanceOf(SchemaValidationException.class)
            .hasMessageContaining("blob");
    }
}
