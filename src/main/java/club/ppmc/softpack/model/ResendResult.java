/**
 * ResendResult.java
 *
 * 重新发送所有排队中构建的结果。
 */
package club.ppmc.softpack.model;

public record ResendResult(String message, int successes, int failures) {

    public boolean allSucceeded() {
        return failures == 0;
    }
}
