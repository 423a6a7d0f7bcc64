package fun.ai.devhub.process;

/**
 * 结束整棵进程树：shell 通常会 fork 子进程，只杀顶层 shell 会留下孤儿进程占着端口
 */
public interface ProcessTreeKiller {

    /**
     * @return 根进程在调用时是否仍存活
     */
    boolean terminateProcessTree(long pid, KillSignal signal);
}
