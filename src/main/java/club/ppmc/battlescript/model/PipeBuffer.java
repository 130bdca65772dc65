/**
 * PipeBuffer.java
 *
 * 单个输出流 (stdout 或 stderr) 的缓冲区，由专门的读取线程写入，其他线程只读。
 * 生命周期与一次进程会话相同。
 */
package club.ppmc.battlescript.model;

public class PipeBuffer {

    private final StringBuilder buffer = new StringBuilder();

    public synchronized void append(char[] chars, int offset, int count) {
        buffer.append(chars, offset, count);
    }

    public synchronized void append(String text) {
        buffer.append(text);
    }

    public synchronized int length() {
        return buffer.length();
    }

    /** 返回从 offset 开始新增的内容。 */
    public synchronized String since(int offset) {
        if (offset >= buffer.length()) {
            return "";
        }
        return buffer.substring(Math.max(0, offset));
    }

    public synchronized String contents() {
        return buffer.toString();
    }
}
