package com.example.namingexif.application.exception;

/**
 * Raised when a use case needs a plugin whose {@code initialize} step reported failure,
 * typically because ExifTool is missing or too old.
 */
public class PluginInitializationException extends ApplicationException {

	/**
	 * @param pluginName name of the plugin that refused to initialize
	 */
    public PluginInitializationException(String pluginName) {
        super("Plugin '" + pluginName + "' could not be initialized; check that ExifTool is installed and on the PATH.");
    }
}
