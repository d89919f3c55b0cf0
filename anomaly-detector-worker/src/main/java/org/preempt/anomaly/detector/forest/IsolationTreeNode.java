package org.preempt.anomaly.detector.forest;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import lombok.Getter;

/**
 * Either a split on a value (points below {@code splitValue} go left) or a leaf holding {@code
 * size} training points.
 */
@Getter
@JsonInclude(Include.NON_NULL)
public class IsolationTreeNode {
  private final Double splitValue;
  private final IsolationTreeNode left;
  private final IsolationTreeNode right;
  private final int size;

  private IsolationTreeNode(
      Double splitValue, IsolationTreeNode left, IsolationTreeNode right, int size) {
    this.splitValue = splitValue;
    this.left = left;
    this.right = right;
    this.size = size;
  }

  static IsolationTreeNode leaf(int size) {
    return new IsolationTreeNode(null, null, null, size);
  }

  static IsolationTreeNode split(
      double splitValue, IsolationTreeNode left, IsolationTreeNode right) {
    return new IsolationTreeNode(splitValue, left, right, left.size + right.size);
  }

  @JsonIgnore
  public boolean isLeaf() {
    return splitValue == null;
  }
}
