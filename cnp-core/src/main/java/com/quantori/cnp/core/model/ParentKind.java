package com.quantori.cnp.core.model;

public enum ParentKind {
  CHAIN,
  RING,
  HETEROATOM
}
