package com.ryuqq.jobqueue.core.model;

/**
 * 서명 digest 인코딩.
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public enum SignatureEncoding {

    HEX,

    BASE64
}
