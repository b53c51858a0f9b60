package com.quantori.cnp.api.indigo;

import com.epam.indigo.Indigo;

/**
 * Pool of Indigo sessions. An Indigo session must not be shared between threads.
 */
public class IndigoPool extends ObjectPool<Indigo> {

  IndigoPool(int maximumPoolSize) {
    super(maximumPoolSize, IndigoFactory::createNewIndigo, Indigo::getSid);
  }
}
