package com.example.paybill.domain.exception;

/**
 * Raised for an employee block whose data line cannot be parsed. Only that block is dropped.
 */
public class MalformedEmployeeBlockException extends DomainException {

    private final String employeeId;

	/**
	 * @param employeeId identifier printed on the data line, when one could be read
	 * @param message    what was wrong with the block
	 */
    public MalformedEmployeeBlockException(String employeeId, String message) {
        super(message);
        this.employeeId = employeeId;
    }

    public String getEmployeeId() {
        return employeeId;
    }
}
