package com.mindthread.backend.thread.domain;

public enum RelationAxis {
  UPSTREAM,
  DOWNSTREAM,
  LATERAL
}
