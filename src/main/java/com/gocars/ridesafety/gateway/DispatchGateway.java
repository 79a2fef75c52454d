package com.gocars.ridesafety.gateway;

import com.gocars.ridesafety.model.EmergencyIncident;
import com.gocars.ridesafety.model.EmergencyResponder;

/**
 * Emergency-services dispatch. Opaque beyond the responder record it returns.
 */
public interface DispatchGateway {

    EmergencyResponder contactEmergencyServices(EmergencyIncident incident);
}
