package com.branchsync.ingest.zk;

/**
 * Reply id counter owned by a single session. Wraps modulo 0xFFFF after each command.
 */
final class ReplyIdSequence {
    private int current;

    int next() {
        int id = current;
        current = (current + 1) % ZkProtocolCodec.REPLY_ID_MODULUS;
        return id;
    }

    int peek() {
        return current;
    }

    void reset() {
        current = 0;
    }
}
