// Part of Tether: https://tether.machinezoo.com
package com.machinezoo.tether;

public enum TaskStatus {
	IDLE,
	PENDING,
	SUCCESS,
	ERROR;
	public boolean settled() {
		return this == SUCCESS || this == ERROR;
	}
}
