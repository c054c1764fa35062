package aster.testengine.core;

/**
 * 夹具共享方式
 *
 * - NONE：每次测试尝试独享，尝试结束即释放；嵌套在其他夹具中时由父夹具独占
 * - PER_CLASS / PER_ASSEMBLY / PER_SESSION：按对应作用域共享，作用域关闭时释放
 * - KEYED：按显式 key 共享，会话结束时释放
 */
public enum SharedType {
  NONE,
  PER_CLASS,
  PER_ASSEMBLY,
  PER_SESSION,
  KEYED
}
