package syncengine.model;

public enum MutationOperation {
  INSERT,
  UPDATE,
  DELETE
}
