/**
 * Artifact.java
 *
 * 制品仓库树中的一个节点（文件夹或文件）。
 * 节点只持有对象 id，不持有内容；需要内容时通过 ArtifactStore.read 读取。
 * git 对象一旦写入就不可变，因此该记录可以在线程间自由共享。
 *
 * @param path 相对仓库根目录的完整路径，不以 "/" 开头。根节点为 ""。
 * @param name 路径的最后一段。
 * @param id 对应的 tree 或 blob 对象 id。
 * @param folder 是否为文件夹（tree）。
 */
package club.ppmc.softpack.model;

import org.eclipse.jgit.lib.ObjectId;

public record Artifact(String path, String name, ObjectId id, boolean folder) {

    /** 父文件夹的路径，根节点的父路径为 ""。 */
    public String parentPath() {
        int lastSlash = path.lastIndexOf('/');
        return lastSlash < 0 ? "" : path.substring(0, lastSlash);
    }
}
