package viewcheck.ast;

/** What a fetch or postfix action does to its source after reading it. */
public enum FetchMode {
  DIRECT,
  INCREMENT,
  DECREMENT;
}
