package com.ryuqq.jobqueue.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * JobSpec 유효성 검증 테스트.
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
class JobSpecTest {

    @Test
    void build_기본값_적용() {
        JobSpec spec = JobSpec.builder(JobType.GET).target("http://localhost:8080/ping").build();

        assertThat(spec.retryLimit()).isEqualTo(10);
        assertThat(spec.payload().isEmpty()).isTrue();
        assertThat(spec.headers()).isEmpty();
        assertThat(spec.auth().mode()).isEqualTo(AuthMode.NONE);
        assertThat(spec.signing().isEnabled()).isFalse();
        assertThat(spec.runAt()).isNull();
    }

    @Test
    void build_HTTP_Job은_절대_URL_필요() {
        assertThatThrownBy(() -> JobSpec.builder(JobType.POST).target("/relative").build())
            .isInstanceOf(JobValidationException.class);
        assertThatThrownBy(() -> JobSpec.builder(JobType.DELETE).target("ftp://host/file").build())
            .isInstanceOf(JobValidationException.class);
        assertThatThrownBy(() -> JobSpec.builder(JobType.GET).target("http://bad host").build())
            .isInstanceOf(JobValidationException.class);
        assertThatThrownBy(() -> JobSpec.builder(JobType.GET).build())
            .isInstanceOf(JobValidationException.class)
            .hasMessageContaining("target");
    }

    @Test
    void build_FUNC_Job은_함수_이름_필요() {
        assertThat(JobSpec.builder(JobType.FUNC).target("billing.close_month").build().target())
            .isEqualTo("billing.close_month");
        assertThatThrownBy(() -> JobSpec.builder(JobType.FUNC).target(" ").build())
            .isInstanceOf(JobValidationException.class);
    }

    @Test
    void build_POLL_Job은_owner_필요_target은_선택() {
        assertThat(JobSpec.builder(JobType.POLL).owner("worker-a").build().owner()).isEqualTo("worker-a");
        assertThatThrownBy(() -> JobSpec.builder(JobType.POLL).build())
            .isInstanceOf(JobValidationException.class)
            .hasMessageContaining("owner");
    }

    @Test
    void build_음수_retryLimit_거부() {
        assertThatThrownBy(() -> JobSpec.builder(JobType.GET).target("https://a.io").retryLimit(-1).build())
            .isInstanceOf(JobValidationException.class)
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void build_jobType_null_거부() {
        assertThatThrownBy(() -> JobSpec.builder(null).target("https://a.io").build())
            .isInstanceOf(JobValidationException.class);
    }
}
