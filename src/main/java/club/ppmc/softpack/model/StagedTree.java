/**
 * StagedTree.java
 *
 * 一次尚未提交的写入：记录构建时的快照（head 提交及其树）以及构建出来的新根树。
 * 提交时以 baseCommit 作为期望的旧值做比较并交换，head 在此期间被移动则视为并发修改。
 *
 * @param baseCommit 快照时的 head 提交；分支尚不存在时为 {@link ObjectId#zeroId()}。
 * @param baseTree 快照时 head 的根树；分支尚不存在时为 null。
 * @param tree 新的根树。
 */
package club.ppmc.softpack.model;

import org.eclipse.jgit.lib.ObjectId;

public record StagedTree(ObjectId baseCommit, ObjectId baseTree, ObjectId tree) {}
