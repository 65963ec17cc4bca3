package syncengine.model;

/** Kind of downstream consumer tracked by the connection registry. */
public enum ClientType {
  SUMMARY_VIEW,
  SCOPED_VIEW,
  MOBILE_APP
}
