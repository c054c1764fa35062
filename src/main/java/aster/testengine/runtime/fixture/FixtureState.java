package aster.testengine.runtime.fixture;

/**
 * 夹具记录的初始化状态
 */
public enum FixtureState {
  UNINITIALIZED,
  INITIALIZING,
  READY,
  FAULTED,
  DISPOSED
}
