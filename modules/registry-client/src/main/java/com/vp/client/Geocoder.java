package com.vp.client;

import java.util.Optional;

public interface Geocoder {

  /** @return the location of the address, or empty when nothing matched */
  Optional<GeoResult> geocode(String address);
}
