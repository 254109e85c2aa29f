package com.ryuqq.ipc.core.stream;

/**
 * {@link StreamReader}가 첫 read에서 cursor를 정하는 방법.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum StartPosition {

    /** 보존 중인 가장 오래된 entry부터 읽음. */
    BEGINNING,

    /** 첫 read 시점의 마지막 entry 이후, 새로 append되는 entry만 읽음. */
    LATEST
}
