package com.workq.process;

/**
 * Minimal worker process for supervisor tests. Behaviour is selected with system properties:
 * {@code stub.silent} never sends the handshake, {@code stub.hangOnTerm} ignores SIGTERM.
 */
public final class StubWorkerMain {

    private StubWorkerMain() {
    }

    public static void main(String[] args) throws InterruptedException {
        long pid = ProcessHandle.current().pid();
        int workerId = workerId(args);
        boolean hangOnTerm = Boolean.getBoolean("stub.hangOnTerm");

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (hangOnTerm) {
                sleepForever();
            }
            System.out.println(IpcMessageCodec.encode(IpcMessage.shutdown(pid, workerId)));
            System.out.flush();
        }));

        System.out.println("stub worker " + workerId + " booting");
        if (!Boolean.getBoolean("stub.silent")) {
            System.out.println(IpcMessageCodec.encode(IpcMessage.started(pid, workerId)));
        }
        System.out.flush();
        sleepForever();
    }

    private static int workerId(String[] args) {
        for (String arg : args) {
            if (arg.startsWith("--workq.worker-id=")) {
                return Integer.parseInt(arg.substring("--workq.worker-id=".length()));
            }
        }
        return -1;
    }

    private static void sleepForever() {
        try {
            Thread.sleep(Long.MAX_VALUE);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
