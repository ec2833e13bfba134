package org.cflow.semantic;

public enum Severity
{
	ERROR
}
