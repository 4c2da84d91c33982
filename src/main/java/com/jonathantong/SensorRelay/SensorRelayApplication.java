package com.jonathantong.SensorRelay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * SensorRelay - real-time sensor notifications from the database binlog
 *
 * Features:
 * 	- Binlog row capture for the states and states_meta tables
 * 	- In-memory metadata_id to entity_id resolution
 * 	- WebSocket fan-out with history replay on connect
 * 	- Bounded retry with server id regeneration on conflict
 */
@SpringBootApplication
public class SensorRelayApplication {

	public static void main(String[] args) {
		SpringApplication.run(SensorRelayApplication.class, args);
	}

}
