package fun.ai.devhub.process;

public enum KillSignal {
    /**
     * 请求退出（ProcessHandle.destroy，Unix 下为 SIGTERM）
     */
    TERM,
    /**
     * 强制结束（ProcessHandle.destroyForcibly，Unix 下为 SIGKILL）
     */
    KILL
}
