package com.branchsync.ingest.zk;

import java.util.Arrays;

/**
 * Decoded device frame: the 8-byte header fields plus whatever payload followed them.
 */
public record ZkFrame(int command, int checksum, int sessionId, int replyId, byte[] data) {

    public ZkFrame {
        data = data == null ? new byte[0] : data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    public boolean isReply(ZkReply reply) {
        return command == reply.code();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ZkFrame frame)) {
            return false;
        }
        return command == frame.command
                && checksum == frame.checksum
                && sessionId == frame.sessionId
                && replyId == frame.replyId
                && Arrays.equals(data, frame.data);
    }

    @Override
    public int hashCode() {
        int result = command;
        result = 31 * result + checksum;
        result = 31 * result + sessionId;
        result = 31 * result + replyId;
        result = 31 * result + Arrays.hashCode(data);
        return result;
    }

    @Override
    public String toString() {
        return "ZkFrame[command=" + ZkReply.describe(command) + ", sessionId=" + sessionId
                + ", replyId=" + replyId + ", data=" + data.length + " bytes]";
    }
}
