package com.vp.kyc;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Ratcliff/Obershelp similarity: find the longest common block, recurse on the
 * pieces left and right of it, and score 2*M/T where M is the total matched
 * length and T the combined length of both strings.
 *
 * Ties on block length go to the earliest start in {@code a}, then in {@code b}.
 * No junk heuristic is applied; inputs are short names.
 */
public final class SequenceMatcher {

  /** A matched block: a[a..a+size) equals b[b..b+size). */
  public record Block(int a, int b, int size) {}

  private final String a;
  private final String b;

  public SequenceMatcher(String a, String b) {
    this.a = a == null ? "" : a;
    this.b = b == null ? "" : b;
  }

  public static double ratio(String a, String b) {
    return new SequenceMatcher(a, b).ratio();
  }

  /** 1.0 for two empty strings. */
  public double ratio() {
    int total = a.length() + b.length();
    if (total == 0) return 1.0;
    int matched = 0;
    for (Block block : matchingBlocks()) {
      matched += block.size();
    }
    return 2.0 * matched / total;
  }

  /** Non-overlapping matched blocks in ascending order. */
  public List<Block> matchingBlocks() {
    List<Block> blocks = new ArrayList<>();
    Deque<int[]> queue = new ArrayDeque<>();
    queue.push(new int[] {0, a.length(), 0, b.length()});

    while (!queue.isEmpty()) {
      int[] r = queue.pop();
      int alo = r[0], ahi = r[1], blo = r[2], bhi = r[3];
      Block m = longestMatch(alo, ahi, blo, bhi);
      if (m.size() == 0) continue;

      blocks.add(m);
      if (alo < m.a() && blo < m.b()) {
        queue.push(new int[] {alo, m.a(), blo, m.b()});
      }
      if (m.a() + m.size() < ahi && m.b() + m.size() < bhi) {
        queue.push(new int[] {m.a() + m.size(), ahi, m.b() + m.size(), bhi});
      }
    }
    blocks.sort(Comparator.comparingInt(Block::a).thenComparingInt(Block::b));
    return blocks;
  }

  /** Longest common substring of a[alo..ahi) and b[blo..bhi). */
  Block longestMatch(int alo, int ahi, int blo, int bhi) {
    int bestI = alo, bestJ = blo, bestSize = 0;
    // prev[j + 1] = length of the common suffix ending at a[i - 1], b[j]
    int[] prev = new int[b.length() + 1];
    int[] cur = new int[b.length() + 1];

    for (int i = alo; i < ahi; i++) {
      Arrays.fill(cur, 0);
      char ch = a.charAt(i);
      for (int j = blo; j < bhi; j++) {
        if (b.charAt(j) != ch) continue;
        int k = prev[j] + 1;
        cur[j + 1] = k;
        if (k > bestSize) {
          bestI = i - k + 1;
          bestJ = j - k + 1;
          bestSize = k;
        }
      }
      int[] t = prev;
      prev = cur;
      cur = t;
    }
    return new Block(bestI, bestJ, bestSize);
  }
}
