package com.ryuqq.jobqueue.core.model;

/**
 * 서명 헤더 값 형식.
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public enum SignatureStyle {

    /** 인코딩된 digest만 기록. */
    PLAIN,

    /** "&lt;algorithm&gt;=" 접두어를 붙여 기록 (예: sha256=ab12...). */
    PREFIXED
}
