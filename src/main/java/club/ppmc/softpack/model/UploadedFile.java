/**
 * UploadedFile.java
 *
 * 写入环境文件夹的一个文件：文件名加内容。用于构建服务上传和模块文件写入。
 */
package club.ppmc.softpack.model;

public record UploadedFile(String name, byte[] content) {}
