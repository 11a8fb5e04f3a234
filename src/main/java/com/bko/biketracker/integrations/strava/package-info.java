@NamedInterface("strava")
package com.bko.biketracker.integrations.strava;

import org.springframework.modulith.NamedInterface;
