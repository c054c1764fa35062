package aster.testengine.core;

/**
 * 钩子作用域层级，由外到内。
 */
public enum ScopeKind {
  SESSION,
  ASSEMBLY,
  CLASS,
  TEST
}
